package com.iplicense.search.analytics;

import com.iplicense.search.query.EntityKind;

public record ClickAttachment(String resultId, int position, EntityKind entityKind) {
}
