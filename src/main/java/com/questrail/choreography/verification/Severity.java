package com.questrail.choreography.verification;

public enum Severity
{
    ERROR,
    WARNING
}
