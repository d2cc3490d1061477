package com.fastextract.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SaveResponse {

    private boolean success;

    /** 持久化后的 id */
    private String id;

    public static SaveResponse saved(String id) {
        return new SaveResponse(true, id);
    }

    public static SaveResponse rejected() {
        return new SaveResponse(false, null);
    }
}
