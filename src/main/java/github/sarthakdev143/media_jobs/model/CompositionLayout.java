package github.sarthakdev143.media_jobs.model;

/**
 * How the visual inputs are arranged in the output frame.
 */
public enum CompositionLayout {
    /** Scenes play one after another. */
    SEQUENCE,
    /** Two inputs share the frame, the primary one on top. */
    STACK_PRIMARY_TOP,
    /** Two inputs share the frame, the primary one at the bottom. */
    STACK_PRIMARY_BOTTOM;

    public boolean isStacked() {
        return this != SEQUENCE;
    }
}
