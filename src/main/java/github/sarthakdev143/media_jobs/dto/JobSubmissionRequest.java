package github.sarthakdev143.media_jobs.dto;

import java.util.List;

public record JobSubmissionRequest(
        List<String> inputs,
        String prompt,
        String captionText,
        String captionPosition,
        String fontStyle,
        Double backgroundVolume,
        Double imageDurationSec,
        String outputPreset,
        String layout) {
}
