package com.scrapouille.dashboard.batch.model;

import com.scrapouille.dashboard.batch.util.UrlSource;

import java.util.List;

public record ParsedUrlsResponse(UrlSource source, int count, List<String> urls) {
}
