package com.bankjob.upload;

/** What the sink answered to an upload. */
public record UploadStatus(boolean accepted, String message) {

    public static UploadStatus ok(String message) {
        return new UploadStatus(true, message);
    }

    public static UploadStatus refused(String message) {
        return new UploadStatus(false, message);
    }
}
