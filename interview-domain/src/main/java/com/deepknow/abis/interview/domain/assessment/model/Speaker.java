package com.deepknow.abis.interview.domain.assessment.model;

public enum Speaker {
    CANDIDATE,
    INTERVIEWER
}
