package com.demo.messaging.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SendMessageRequest {
    private String body;

    // Client-generated; a retry must reuse the value of the first attempt
    private String idempotencyKey;
}
