package com.odin.share_relay_service.utility;

import java.util.List;

import org.apache.commons.lang.exception.ExceptionUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.odin.share_relay_service.dto.ResponseDTO;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
public class Utility {
	
	@Autowired
	private ObjectMapper objectMapper;
	
	@Autowired
	private RestTemplate restTemplate;

	/**
	 * Convert the loosely typed {@code data} of a {@link ResponseDTO} into a DTO.
	 * A list yields its first element; anything unconvertible yields null.
	 */
	public <E> E getAnInstance(Object data, Class<E> targetClass) {
		Object single = data instanceof List<?> ? firstOf((List<?>) data) : data;
		if (single == null) {
			return null;
		}
		try {
			return objectMapper.convertValue(single, targetClass);
		} catch (IllegalArgumentException e) {
			log.error("Error occured while converting to {} : {}", targetClass.getSimpleName(),
					ExceptionUtils.getStackTrace(e));
			return null;
		}
	}

	/**
	 * JSON call to a collaborator service, propagating the correlation id.
	 *
	 * @throws RuntimeException on any transport failure or non-2xx status
	 */
	public <T> ResponseDTO makeRestCall(String url, T requestBody, HttpMethod httpMethod) {
		long startTime = System.currentTimeMillis();
		try {
			HttpHeaders headers = new HttpHeaders();
			headers.setContentType(MediaType.APPLICATION_JSON);

			String correlationId = CorrelationIdUtil.getCorrelationId();
			if (correlationId == null) {
				correlationId = CorrelationIdUtil.generateCorrelationId();
			}
			headers.set(CorrelationIdUtil.CORRELATION_ID_HEADER, correlationId);
			HttpEntity<T> entity = new HttpEntity<>(requestBody, headers);

			ResponseEntity<ResponseDTO> response = restTemplate.exchange(url, httpMethod, entity, ResponseDTO.class);

			if (!response.getStatusCode().is2xxSuccessful()) {
				throw new RuntimeException("Failed with HTTP error code : " + response.getStatusCode());
			}
			log.debug("REST call {} {} completed in {}ms", httpMethod, url, System.currentTimeMillis() - startTime);
			return response.getBody();
		} catch (RuntimeException e) {
			throw new RuntimeException("Error while making REST call to " + url, e);
		}
	}

	private static Object firstOf(List<?> list) {
		return list.isEmpty() ? null : list.get(0);
	}

}
