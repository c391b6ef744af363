package com.z254.lumina.tutor.api.dto;

import com.z254.lumina.tutor.domain.model.ConversationContext;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for the query endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {

    @NotBlank(message = "Query is required")
    @Size(max = 5000, message = "Query must be less than 5000 characters")
    private String query;

    private ConversationContext context;
}
