package com.scrapouille.dashboard.batch.model;

public record ApiErrorBody(String detail, String code) {
}
