package com.github.odeint.calculus.exceptions;

public class InvalidConfigurationException extends Exception {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String field, double value, String requirement) {
        super(String.format("Invalid %s = %s: %s", field, value, requirement));
    }

}
