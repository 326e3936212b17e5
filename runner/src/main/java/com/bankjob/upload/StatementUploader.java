package com.bankjob.upload;

/** Sends an OFX document to an account aggregation service. */
@FunctionalInterface
public interface StatementUploader {

    UploadStatus upload(String ofxDocument) throws UploadException;
}
