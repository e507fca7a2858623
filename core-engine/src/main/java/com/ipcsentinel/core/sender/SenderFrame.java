package com.ipcsentinel.core.sender;

import java.util.Objects;

/**
 * Frame metadata the IPC transport reports for the caller.
 *
 * @since 1.0.0
 */
public final class SenderFrame {

    private final String url;
    private final boolean hasParentFrame;
    private final int frameId;

    /**
     * @param url            URL loaded in the calling frame
     * @param hasParentFrame {@code true} if the frame is nested in another
     *                       frame (an iframe) rather than being top-level
     * @param frameId        transport-assigned frame identifier
     */
    public SenderFrame(String url, boolean hasParentFrame, int frameId) {
        this.url = url;
        this.hasParentFrame = hasParentFrame;
        this.frameId = frameId;
    }

    /**
     * @return a top-level frame with id 1
     */
    public static SenderFrame topLevel(String url) {
        return new SenderFrame(url, false, 1);
    }

    public String getUrl() {
        return url;
    }

    public boolean hasParentFrame() {
        return hasParentFrame;
    }

    public int getFrameId() {
        return frameId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SenderFrame that))
            return false;
        return hasParentFrame == that.hasParentFrame
                && frameId == that.frameId
                && Objects.equals(url, that.url);
    }

    @Override
    public int hashCode() {
        return Objects.hash(url, hasParentFrame, frameId);
    }

    @Override
    public String toString() {
        return "SenderFrame{url='" + url + "', hasParentFrame=" + hasParentFrame + ", frameId=" + frameId + '}';
    }
}
