package com.keepsake.testing;

public enum Color {
    RED, GREEN, BLUE
}
