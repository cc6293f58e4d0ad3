package com.flagship.account_pro.web;

import lombok.Value;

import java.io.Serializable;

/**
 * One-shot message shown on the next rendered page.
 * Stored in the session between a redirect and the following GET.
 */
@Value
public class Notice implements Serializable {

    public static final String FLASH_ATTRIBUTE = "notices";

    Category category;
    String message;

    public enum Category {
        SUCCESS,
        ERROR
    }

    public static Notice success(String message) {
        return new Notice(Category.SUCCESS, message);
    }

    public static Notice error(String message) {
        return new Notice(Category.ERROR, message);
    }
}
