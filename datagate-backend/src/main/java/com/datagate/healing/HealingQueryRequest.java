package com.datagate.healing;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class HealingQueryRequest {
    @NotBlank
    @Pattern(regexp = "[A-Za-z_][A-Za-z0-9_.]*", message = "must be a plain table name")
    private String table;

    @NotBlank
    @Pattern(regexp = "[A-Za-z_][A-Za-z0-9_]*", message = "must be a plain column name")
    private String column;

    private String filter;
}
