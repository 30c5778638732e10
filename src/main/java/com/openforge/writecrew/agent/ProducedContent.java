package com.openforge.writecrew.agent;

import com.openforge.writecrew.usage.ActualUsage;

/**
 * @param content text to insert or replace with; ignored for deletes and
 *                non-document actions
 */
public record ProducedContent(String content, ActualUsage usage) {

    public ProducedContent {
        content = content == null ? "" : content;
        usage = usage == null ? ActualUsage.none() : usage;
    }
}
