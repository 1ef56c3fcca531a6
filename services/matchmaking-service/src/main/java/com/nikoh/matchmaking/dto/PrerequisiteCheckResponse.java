package com.nikoh.matchmaking.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.nikoh.matchmaking.domain.DocumentType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Whether a document of the given type can be verified automatically for the user
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PrerequisiteCheckResponse {

    private DocumentType documentType;

    private boolean canAutoVerify;

    private String reason;
}
