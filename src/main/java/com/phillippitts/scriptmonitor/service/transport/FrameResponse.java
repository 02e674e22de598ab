package com.phillippitts.scriptmonitor.service.transport;

/**
 * Acknowledgement for one request frame.
 *
 * @param checkcode   responder's check code
 * @param requestCode request code of the acknowledged frame
 * @param status      unsigned status byte; {@link FrameCodec#STATUS_OK} on success
 */
public record FrameResponse(int checkcode, int requestCode, int status) {

    public boolean isOk() {
        return status == FrameCodec.STATUS_OK;
    }
}
