package com.phillippitts.scriptmonitor.service.transport;

/**
 * One decoded request frame.
 *
 * @param checkcode   sender's check code (not validated by the monitor server)
 * @param requestCode request code, echoed in the response
 * @param text        payload decoded as UTF-8, malformed bytes replaced
 */
public record Frame(int checkcode, int requestCode, String text) {

    public Frame {
        text = text == null ? "" : text;
    }
}
