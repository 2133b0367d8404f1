package github.sarthakdev143.media_jobs.model;

public enum CaptionPosition {
    TOP,
    CENTER,
    BOTTOM;

    public String yExpression() {
        return switch (this) {
            case TOP -> "h*0.1";
            case CENTER -> "(h-text_h)/2";
            case BOTTOM -> "h*0.8-text_h";
        };
    }
}
