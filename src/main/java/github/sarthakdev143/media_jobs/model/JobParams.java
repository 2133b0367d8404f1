package github.sarthakdev143.media_jobs.model;

public record JobParams(
        String prompt,
        String captionText,
        CaptionPosition captionPosition,
        String fontStyle,
        double backgroundVolume,
        double imageDurationSec,
        OutputPreset outputPreset,
        CompositionLayout layout) {

    public JobParams {
        prompt = prompt == null || prompt.isBlank() ? null : prompt;
        captionText = captionText == null || captionText.isBlank() ? null : captionText;
        captionPosition = captionPosition == null ? CaptionPosition.BOTTOM : captionPosition;
        fontStyle = fontStyle == null || fontStyle.isBlank() ? null : fontStyle;
        outputPreset = outputPreset == null ? OutputPreset.PORTRAIT_9_16 : outputPreset;
        layout = layout == null ? CompositionLayout.SEQUENCE : layout;
    }

    public boolean requiresGeneration() {
        return prompt != null;
    }
}
