package com.flagship.account_pro.web;

import lombok.Value;

import java.io.Serializable;
import java.util.List;

/**
 * Notices carried across a redirect as a single flash attribute.
 */
@Value
public class Notices implements Serializable {

    List<Notice> items;

    public static Notices of(Notice... notices) {
        return new Notices(List.of(notices));
    }

    public static Notices of(List<Notice> notices) {
        return new Notices(List.copyOf(notices));
    }
}
