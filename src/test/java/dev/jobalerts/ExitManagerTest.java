package dev.jobalerts;

import org.junit.jupiter.api.Test;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExitManagerTest {

  @Test
  void exitClosesContextWithoutStoppingTheTestJvm() {
    ConfigurableApplicationContext context = mock(ConfigurableApplicationContext.class);
    when(context.getBeansOfType(org.springframework.boot.ExitCodeGenerator.class)).thenReturn(Map.of());
    ExitManager exitManager = new ExitManager(context);

    exitManager.exit(1);

    assertThat(exitManager.isTest()).isTrue();
    verify(context).close();
  }
}
