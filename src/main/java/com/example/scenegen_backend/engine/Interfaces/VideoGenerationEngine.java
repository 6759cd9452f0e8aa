package com.example.scenegen_backend.engine.Interfaces;

import com.example.scenegen_backend.exception.UpstreamInfo;
import com.example.scenegen_backend.util.ErrorCode;
import com.example.scenegen_backend.util.ProviderState;

import java.util.Map;

/**
 * External asynchronous video generation API. Failures come back as values; only {@link #download}
 * throws.
 */
public interface VideoGenerationEngine {

    record ProviderError(ErrorCode code, String message, UpstreamInfo upstream, String upstreamDetail) {}

    record SubmitResult(boolean success, String jobId, ProviderError error) {
        public static SubmitResult ok(String jobId) {
            return new SubmitResult(true, jobId, null);
        }

        public static SubmitResult failed(ProviderError error) {
            return new SubmitResult(false, null, error);
        }
    }

    record StatusResult(String jobId,
                        ProviderState state,
                        Integer progress,
                        String videoUrl,
                        String failureReason,
                        ProviderError error) {
        public static StatusResult failed(String jobId, ProviderError error) {
            return new StatusResult(jobId, ProviderState.UNKNOWN, null, null, null, error);
        }

        public boolean ok() {
            return error == null;
        }
    }

    /** Provider request body for a keyframe pair, already reduced to what {@code model} accepts. */
    Map<String, Object> buildPayload(String prompt, String model, String startUrl, String endUrl);

    SubmitResult submit(Map<String, Object> payload);

    /** One status request, never retried here. */
    StatusResult status(String jobId);

    /**
     * Fetches a rendered asset.
     *
     * @throws com.example.scenegen_backend.exception.SceneGenException with {@code ARCHIVE_ERROR}
     */
    byte[] download(String url);
}
