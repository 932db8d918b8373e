package model;

public enum ScoreKey {
    CAPABILITY, SAFETY
}
