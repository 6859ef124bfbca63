package com.umitunal.sendlater.core;

public class DuplicateJobException extends JobStoreException {

    public DuplicateJobException(String jobId) {
        super("Job id already used: " + jobId);
    }
}
