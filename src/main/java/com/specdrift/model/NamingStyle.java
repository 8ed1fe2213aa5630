package com.specdrift.model;

public enum NamingStyle {
    SNAKE_CASE,
    CAMEL_CASE,
    PASCAL_CASE,
    SCREAMING_SNAKE_CASE
}
