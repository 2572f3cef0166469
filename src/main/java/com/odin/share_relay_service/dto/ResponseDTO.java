package com.odin.share_relay_service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Envelope returned by the membership service. {@code data} is loosely typed and is
 * converted with {@link com.odin.share_relay_service.utility.Utility#getAnInstance}.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ResponseDTO {

	private Integer statusCode;
	private String status;
	private String message;
	private Object data;

	public boolean hasData() {
		return data != null;
	}
}
