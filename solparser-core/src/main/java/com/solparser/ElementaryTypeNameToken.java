package com.solparser;

/**
 * An elementary type keyword together with its size parameters, e.g. {@code uint8}
 * is {@code (UINT_M, 8, 0)} and {@code fixed128x18} is {@code (FIXED_MXN, 128, 18)}.
 */
public record ElementaryTypeNameToken(TokenType token, int firstNumber, int secondNumber) {

    public ElementaryTypeNameToken {
        if (!token.isElementaryTypeName()) {
            throw new IllegalStateException("Not an elementary type token: " + token);
        }
    }

    public static ElementaryTypeNameToken of(TokenType token) {
        return new ElementaryTypeNameToken(token, 0, 0);
    }

    /**
     * Source spelling of the type, including its sizes.
     */
    public String typeName() {
        return switch (token) {
            case INT_M, UINT_M, BYTES_M -> token.text() + firstNumber;
            case FIXED_MXN, UFIXED_MXN -> token.text() + firstNumber + "x" + secondNumber;
            default -> token.text();
        };
    }

    @Override
    public String toString() {
        return typeName();
    }
}
