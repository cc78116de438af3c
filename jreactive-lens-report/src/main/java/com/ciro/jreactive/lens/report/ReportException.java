package com.ciro.jreactive.lens.report;

/** Fallo al serializar o leer un informe. */
public class ReportException extends RuntimeException {

    public ReportException(String message, Throwable cause) {
        super(message, cause);
    }
}
