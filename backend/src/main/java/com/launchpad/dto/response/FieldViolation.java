package com.launchpad.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One rejected request property and the constraints it broke.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FieldViolation {

    private String property;

    private List<String> constraints;
}
