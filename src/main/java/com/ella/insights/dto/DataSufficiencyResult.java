package com.ella.insights.dto;

public record DataSufficiencyResult(boolean hasSufficientData, String message, int monthsOfData) {

    public static DataSufficiencyResult sufficient(int monthsOfData) {
        return new DataSufficiencyResult(true, null, monthsOfData);
    }

    public static DataSufficiencyResult insufficient(String message) {
        return new DataSufficiencyResult(false, message, 0);
    }
}
