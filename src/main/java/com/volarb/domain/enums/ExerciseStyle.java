package com.volarb.domain.enums;

public enum ExerciseStyle {
    EUROPEAN,
    AMERICAN
}
