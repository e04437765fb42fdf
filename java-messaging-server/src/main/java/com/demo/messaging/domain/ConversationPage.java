package com.demo.messaging.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationPage {

    @Builder.Default
    private List<ConversationSummary> items = new ArrayList<>();

    // null when there are no further pages
    private String nextCursor;

    public static ConversationPage empty() {
        return ConversationPage.builder().build();
    }
}
