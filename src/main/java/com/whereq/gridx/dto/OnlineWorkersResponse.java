package com.whereq.gridx.dto;

import lombok.Value;

import java.util.List;

@Value
public class OnlineWorkersResponse {
    List<String> workers;

    public int getCount() {
        return workers.size();
    }
}
