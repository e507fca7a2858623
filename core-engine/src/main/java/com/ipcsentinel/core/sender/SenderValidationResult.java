package com.ipcsentinel.core.sender;

import java.util.Optional;

/**
 * Outcome of {@link SenderValidator#validateSender}.
 *
 * <p>
 * {@code origin} and {@code frameId} are present whenever the frame URL could
 * be parsed, including for some rejections, so the rejection can be logged
 * with them.
 * </p>
 */
public final class SenderValidationResult {

    private final boolean valid;
    private final String reason;
    private final String origin;
    private final Integer frameId;

    private SenderValidationResult(boolean valid, String reason, String origin, Integer frameId) {
        this.valid = valid;
        this.reason = reason;
        this.origin = origin;
        this.frameId = frameId;
    }

    static SenderValidationResult valid(String origin, int frameId) {
        return new SenderValidationResult(true, null, origin, frameId);
    }

    static SenderValidationResult invalid(String reason) {
        return new SenderValidationResult(false, reason, null, null);
    }

    static SenderValidationResult invalid(String reason, String origin, int frameId) {
        return new SenderValidationResult(false, reason, origin, frameId);
    }

    public boolean isValid() {
        return valid;
    }

    public Optional<String> getReason() {
        return Optional.ofNullable(reason);
    }

    public Optional<String> getOrigin() {
        return Optional.ofNullable(origin);
    }

    public Optional<Integer> getFrameId() {
        return Optional.ofNullable(frameId);
    }

    @Override
    public String toString() {
        return valid
                ? "SenderValidationResult{valid, origin='" + origin + "', frameId=" + frameId + '}'
                : "SenderValidationResult{invalid, reason='" + reason + "', origin='" + origin + "'}";
    }
}
