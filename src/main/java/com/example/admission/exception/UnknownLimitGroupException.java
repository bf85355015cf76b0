package com.example.admission.exception;

public class UnknownLimitGroupException extends AdmissionException {

    public UnknownLimitGroupException(String group) {
        super("Unknown limit group '" + group + "'");
    }
}
