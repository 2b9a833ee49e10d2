package dev.jobalerts.matching;

/**
 * Scores how similar a keyword is to a piece of text.
 */
public interface SimilarityScorer {

    /**
     * @return similarity in [0,100], 100 meaning the inputs are equivalent
     */
    double score(String keyword, String text);
}
