package com.example.support.domain;

import java.io.Serializable;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderSummary implements Serializable {

    private Long id;
    private Long accountId;
    private String orderNumber;
    private String storeId;
    private LocalDateTime createdAt;
}
