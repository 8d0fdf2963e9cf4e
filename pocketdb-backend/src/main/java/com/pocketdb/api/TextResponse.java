package com.pocketdb.api;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Single string result, e.g. a key-value read or a formatted command reply. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TextResponse {
    private String value;
}
