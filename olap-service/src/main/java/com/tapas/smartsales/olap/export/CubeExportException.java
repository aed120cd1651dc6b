package com.tapas.smartsales.olap.export;

public class CubeExportException extends RuntimeException {

    public CubeExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
