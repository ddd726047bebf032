package com.example.support.domain;

import java.io.Serializable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Account implements Serializable {

    private Long id;
    private String name;
    private String phone;
    private String externalIdentity;

    public boolean hasPhone() {
        return phone != null && !phone.isBlank();
    }
}
