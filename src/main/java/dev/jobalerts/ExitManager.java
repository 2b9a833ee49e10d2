package dev.jobalerts;

import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;

/**
 * Closes the application context and ends the process with a status code.
 * The JVM is left running when JUnit is on the classpath so tests can call it.
 */
@Component
public class ExitManager {

  private final ConfigurableApplicationContext context;

  public ExitManager(ConfigurableApplicationContext context) {
    this.context = context;
  }

  public void exit(int status) {
    int code = SpringApplication.exit(context, () -> status);
    if (!isTest()) {
      System.exit(code);
    }
  }

  protected boolean isTest() {
    return ClassUtils.isPresent("org.junit.jupiter.api.Test", getClass().getClassLoader());
  }
}
