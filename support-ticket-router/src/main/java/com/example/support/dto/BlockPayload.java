package com.example.support.dto;

import lombok.Data;

@Data
public class BlockPayload {

    private boolean blocked = true;
}
