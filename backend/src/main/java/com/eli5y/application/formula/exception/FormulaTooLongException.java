package com.eli5y.application.formula.exception;

public class FormulaTooLongException extends RuntimeException {

    public FormulaTooLongException(String message) {
        super(message);
    }
}
