package com.tapas.smartsales.olap.service;

public enum StaffingLevel {
    PEAK,
    NORMAL,
    LOW
}
