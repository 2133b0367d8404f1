package github.sarthakdev143.media_jobs.integration.generation;

public interface GenerationClient {

    /**
     * Runs a generation to completion and returns where the produced clip can be downloaded.
     *
     * @throws github.sarthakdev143.media_jobs.exception.PermanentJobException for rejected
     *         credentials or an invalid request
     * @throws github.sarthakdev143.media_jobs.exception.TransientUpstreamException once the
     *         bounded retries of a transient failure are used up
     */
    ContentRef generate(GenerationRequest request);
}
