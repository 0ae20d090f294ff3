package com.spreadsheet.reactive.controllers;

import com.spreadsheet.reactive.SpreadsheetApplication;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests using a running server instance (RANDOM_PORT).
 * These tests verify end-to-end HTTP behavior and JSON handling.
 */
@SpringBootTest(
        classes = SpreadsheetApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT
)
@ActiveProfiles("test")
class SheetControllerIntegrationTest {

    @LocalServerPort
    int port;

    private final RestTemplate restTemplate = new RestTemplate();

    private String url(String path) {
        return "http://localhost:" + port + path;
    }

    private long createSheet(String body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        ResponseEntity<Long> response =
                restTemplate.postForEntity(url("/sheet"), new HttpEntity<>(body, headers), Long.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertNotNull(response.getBody());
        return response.getBody();
    }

    private ResponseEntity<List> put(long sheetId, String cellId, String rawValue) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.TEXT_PLAIN);
        return restTemplate.exchange(url("/sheet/" + sheetId + "/cell/" + cellId),
                HttpMethod.PUT, new HttpEntity<>(rawValue, headers), List.class);
    }

    private int get(long sheetId, String cellId) {
        Integer value = restTemplate.getForObject(url("/sheet/" + sheetId + "/cell/" + cellId), Integer.class);
        assertNotNull(value);
        return value;
    }

    /**
     * Range sum and transitive update through HTTP.
     */
    @Test
    void testRangeAndPropagation() {
        long sheetId = createSheet("{\"rows\": 3, \"columns\": 3}");

        put(sheetId, "A1", "10");
        put(sheetId, "C3", "=A1:C2");
        assertEquals(10, get(sheetId, "C3"));

        ResponseEntity<List> response = put(sheetId, "C2", "=A1");
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(List.of("C3"), response.getBody());
        assertEquals(20, get(sheetId, "C3"));

        ResponseEntity<List> fromA1 = put(sheetId, "A1", "1");
        assertEquals(List.of("C2", "C3"), fromA1.getBody());
        assertEquals(2, get(sheetId, "C3"));
    }

    @Test
    void testCycleIsBadRequestAndReverted() {
        long sheetId = createSheet("{\"rows\": 3, \"columns\": 3}");
        put(sheetId, "A1", "=B1");
        put(sheetId, "B1", "7");

        HttpClientErrorException ex = assertThrows(HttpClientErrorException.class,
                () -> put(sheetId, "B1", "=A1"));
        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        assertTrue(ex.getResponseBodyAsString().contains("CIRCULAR_REFERENCE"));

        assertEquals(7, get(sheetId, "B1"));
        assertEquals(7, get(sheetId, "A1"));
    }

    @Test
    void testErrorCodes() {
        long sheetId = createSheet("{\"rows\": 2, \"columns\": 2}");

        HttpClientErrorException parse = assertThrows(HttpClientErrorException.class,
                () -> put(sheetId, "A1", "=A1+"));
        assertEquals(HttpStatus.BAD_REQUEST, parse.getStatusCode());
        assertTrue(parse.getResponseBodyAsString().contains("PARSE_ERROR"));

        HttpClientErrorException outOfBounds = assertThrows(HttpClientErrorException.class,
                () -> get(sheetId, "C1"));
        assertTrue(outOfBounds.getResponseBodyAsString().contains("OUT_OF_BOUNDS"));

        HttpClientErrorException invalidId = assertThrows(HttpClientErrorException.class,
                () -> get(sheetId, "a1"));
        assertTrue(invalidId.getResponseBodyAsString().contains("INVALID_CELL_ID"));

        HttpClientErrorException missing = assertThrows(HttpClientErrorException.class,
                () -> get(987654321L, "A1"));
        assertEquals(HttpStatus.NOT_FOUND, missing.getStatusCode());
    }

    @Test
    void testOversizedSheetIsBadRequest() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpClientErrorException ex = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.postForEntity(url("/sheet"),
                        new HttpEntity<>("{\"rows\": 200000000}", headers), Long.class));
        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        assertTrue(ex.getResponseBodyAsString().contains("INVALID_ARGUMENT"));
    }

    /**
     * Omitted dimensions come from application-test.properties; an empty body writes 0.
     */
    @Test
    void testDefaultsAndEmptyBody() {
        long sheetId = createSheet("{}");
        ResponseEntity<Map> sheet = restTemplate.getForEntity(url("/sheet/" + sheetId), Map.class);
        assertEquals(10 * 5, sheet.getBody().size());
        assertTrue(sheet.getBody().containsKey("E10"));

        put(sheetId, "A1", "5");
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.TEXT_PLAIN);
        restTemplate.exchange(url("/sheet/" + sheetId + "/cell/A1"),
                HttpMethod.PUT, new HttpEntity<>(headers), List.class);
        assertEquals(0, get(sheetId, "A1"));
    }

    @Test
    void testDependentsAndDetails() {
        long sheetId = createSheet("{\"rows\": 3, \"columns\": 3}");
        put(sheetId, "B1", "=A1");
        put(sheetId, "C1", "=A1+B1");

        ResponseEntity<Map> dependents =
                restTemplate.getForEntity(url("/sheet/" + sheetId + "/dependents"), Map.class);
        assertEquals(List.of("B1", "C1"), dependents.getBody().get("A1"));
        assertEquals(List.of("C1"), dependents.getBody().get("B1"));

        ResponseEntity<Map> details =
                restTemplate.getForEntity(url("/sheet/" + sheetId + "/cell/C1/details"), Map.class);
        assertEquals("=A1+B1", details.getBody().get("formula"));
        assertEquals(0, details.getBody().get("value"));
        assertEquals(List.of(), details.getBody().get("dependents"));
    }
}
