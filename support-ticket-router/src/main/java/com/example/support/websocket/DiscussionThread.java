package com.example.support.websocket;

import java.io.Serializable;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiscussionThread implements Serializable {

    private long threadId;
    private String groupId;
    private String title;
    private boolean closed;
    private Instant createdAt;
}
