package com.chambua.schoolsports.util;

import java.time.LocalDate;

public final class AgeCalculator {

    private AgeCalculator() {}

    /**
     * Whole years between {@code birthDate} and {@code today}: the year difference, minus one when
     * today's month/day falls before the birth month/day.
     */
    public static int ageOn(LocalDate birthDate, LocalDate today) {
        int age = today.getYear() - birthDate.getYear();
        int monthDiff = today.getMonthValue() - birthDate.getMonthValue();
        if (monthDiff < 0 || (monthDiff == 0 && today.getDayOfMonth() < birthDate.getDayOfMonth())) {
            age--;
        }
        return age;
    }
}
