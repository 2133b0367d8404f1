package github.sarthakdev143.media_jobs.service.impl;

import github.sarthakdev143.media_jobs.config.MediaJobsProperties;
import github.sarthakdev143.media_jobs.dto.JobSubmissionRequest;
import github.sarthakdev143.media_jobs.integration.storage.ArtifactRef;
import github.sarthakdev143.media_jobs.model.CaptionPosition;
import github.sarthakdev143.media_jobs.model.CompositionLayout;
import github.sarthakdev143.media_jobs.model.JobParams;
import github.sarthakdev143.media_jobs.model.MediaKind;
import github.sarthakdev143.media_jobs.model.OutputPreset;
import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

@Component
public class JobRequestValidator {

    private static final int MAX_INPUTS = 10;
    private static final int MAX_PROMPT_LENGTH = 2000;
    private static final int MAX_CAPTION_LENGTH = 500;
    private static final double DEFAULT_BACKGROUND_VOLUME = 0.3;
    private static final double MIN_IMAGE_DURATION_SECONDS = 0.5;
    private static final double MAX_IMAGE_DURATION_SECONDS = 600.0;
    private static final double DEFAULT_IMAGE_DURATION_SECONDS = 5.0;
    private static final long MAX_UPLOAD_BYTES = 500L * 1024 * 1024;
    private static final Set<String> ALLOWED_UPLOAD_TYPE_PREFIXES = Set.of("image/", "video/", "audio/");

    private final MediaJobsProperties properties;

    public JobRequestValidator(MediaJobsProperties properties) {
        this.properties = properties;
    }

    public ValidatedSubmission normalizeAndValidate(JobSubmissionRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required.");
        }

        List<String> inputs = normalizeInputs(request.inputs());
        String prompt = trimToNull(request.prompt());
        if (prompt != null && prompt.length() > MAX_PROMPT_LENGTH) {
            throw new IllegalArgumentException("prompt must be at most " + MAX_PROMPT_LENGTH + " characters.");
        }

        int audioInputs = 0;
        int visualInputs = 0;
        int imageInputs = 0;
        for (String input : inputs) {
            MediaKind kind = kindOf(input);
            if (kind == MediaKind.AUDIO) {
                audioInputs++;
            } else {
                visualInputs++;
                if (kind == MediaKind.IMAGE) {
                    imageInputs++;
                }
            }
        }
        if (audioInputs > 1) {
            throw new IllegalArgumentException("At most one audio input is allowed.");
        }
        if (visualInputs == 0 && prompt == null) {
            throw new IllegalArgumentException("At least one image or video input is required unless a prompt is given.");
        }

        CompositionLayout layout = parseEnum(CompositionLayout.class, request.layout(), "layout");
        // A prompt without an image input adds a generated clip in front of the other scenes.
        int renderedScenes = visualInputs + (prompt != null && imageInputs == 0 ? 1 : 0);
        if (layout != null && layout.isStacked() && renderedScenes != 2) {
            throw new IllegalArgumentException("layout " + layout + " needs exactly two visual inputs.");
        }

        String captionText = trimToNull(request.captionText());
        if (captionText != null && captionText.length() > MAX_CAPTION_LENGTH) {
            throw new IllegalArgumentException("captionText must be at most " + MAX_CAPTION_LENGTH + " characters.");
        }

        String fontStyle = trimToNull(request.fontStyle());
        if (fontStyle != null && !properties.getTransform().getFonts().containsKey(fontStyle)) {
            throw new IllegalArgumentException(
                    "fontStyle must be one of " + properties.getTransform().getFonts().keySet() + ".");
        }

        double backgroundVolume = request.backgroundVolume() == null
                ? DEFAULT_BACKGROUND_VOLUME
                : request.backgroundVolume();
        if (!(backgroundVolume >= 0.0 && backgroundVolume <= 1.0)) {
            throw new IllegalArgumentException("backgroundVolume must be between 0.0 and 1.0.");
        }

        double imageDurationSec = request.imageDurationSec() == null
                ? DEFAULT_IMAGE_DURATION_SECONDS
                : request.imageDurationSec();
        if (!(imageDurationSec >= MIN_IMAGE_DURATION_SECONDS && imageDurationSec <= MAX_IMAGE_DURATION_SECONDS)) {
            throw new IllegalArgumentException(
                    "imageDurationSec must be between " + MIN_IMAGE_DURATION_SECONDS + " and "
                            + MAX_IMAGE_DURATION_SECONDS + " seconds.");
        }

        JobParams params = new JobParams(
                prompt,
                captionText,
                parseEnum(CaptionPosition.class, request.captionPosition(), "captionPosition"),
                fontStyle,
                backgroundVolume,
                imageDurationSec,
                parseEnum(OutputPreset.class, request.outputPreset(), "outputPreset"),
                layout);
        return new ValidatedSubmission(inputs, params);
    }

    public MediaKind validateUpload(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("file is required.");
        }
        if (file.getSize() > MAX_UPLOAD_BYTES) {
            throw new IllegalArgumentException("file must be at most " + MAX_UPLOAD_BYTES + " bytes.");
        }

        String contentType = file.getContentType();
        String normalizedType = contentType == null ? "" : contentType.toLowerCase(Locale.ROOT);
        if (ALLOWED_UPLOAD_TYPE_PREFIXES.stream().noneMatch(normalizedType::startsWith)) {
            throw new IllegalArgumentException("file must have an image/*, video/* or audio/* content type.");
        }

        return MediaKind.fromFileName(file.getOriginalFilename())
                .orElseThrow(() -> new IllegalArgumentException(
                        "file name must end with a supported extension (jpg, png, mp4, mov, webm, mkv, mp3, wav, aac, m4a, ogg)."));
    }

    private List<String> normalizeInputs(List<String> inputs) {
        if (inputs == null || inputs.isEmpty()) {
            return List.of();
        }
        if (inputs.size() > MAX_INPUTS) {
            throw new IllegalArgumentException("A maximum of " + MAX_INPUTS + " inputs is allowed.");
        }

        List<String> normalized = new ArrayList<>();
        for (int index = 0; index < inputs.size(); index++) {
            String input = trimToNull(inputs.get(index));
            if (input == null) {
                throw new IllegalArgumentException("inputs[" + index + "] must not be blank.");
            }
            if (!isResolvable(input)) {
                throw new IllegalArgumentException(
                        "inputs[" + index + "] must be an s3://, local:// or http(s):// reference.");
            }
            normalized.add(input);
        }
        return normalized;
    }

    private boolean isResolvable(String input) {
        return ArtifactRef.tryParse(input).isPresent()
                || input.startsWith("https://")
                || input.startsWith("http://");
    }

    private MediaKind kindOf(String input) {
        Optional<ArtifactRef> ref = ArtifactRef.tryParse(input);
        String fileName = ref.map(ArtifactRef::key).orElse(input);
        return MediaKind.fromFileName(fileName)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported input format: " + input));
    }

    private <E extends Enum<E>> E parseEnum(Class<E> type, String value, String fieldName) {
        String normalized = trimToNull(value);
        if (normalized == null) {
            return null;
        }
        try {
            return Enum.valueOf(type, normalized.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            List<String> allowed = new ArrayList<>();
            for (E constant : type.getEnumConstants()) {
                allowed.add(constant.name());
            }
            throw new IllegalArgumentException(fieldName + " must be one of " + allowed + ".", e);
        }
    }

    private String trimToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    public record ValidatedSubmission(List<String> inputRefs, JobParams params) {
    }
}
