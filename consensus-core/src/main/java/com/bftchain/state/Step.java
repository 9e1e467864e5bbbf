package com.bftchain.state;

/**
 * Steps of a round, in the order they are entered. {@link #NEW_HEIGHT} sits
 * between a commit and round 0 of the following height.
 */
public enum Step {
    PROPOSE,
    PREVOTE,
    PRECOMMIT,
    COMMIT,
    // block committed, waiting out the commit timeout before round 0
    NEW_HEIGHT
}
