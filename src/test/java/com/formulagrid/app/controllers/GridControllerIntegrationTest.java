package com.formulagrid.app.controllers;

import com.formulagrid.app.FormulaGridApplication;
import org.junit.jupiter.api.BeforeEach;
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
        classes = FormulaGridApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT
)
@ActiveProfiles("test")
class GridControllerIntegrationTest {

    @LocalServerPort
    int port;

    private final RestTemplate restTemplate = new RestTemplate();

    @BeforeEach
    void resetGrid() {
        restTemplate.delete(url("/grid"));
    }

    /**
     * Sets a small chain of formulas, then changes the head of the chain.
     */
    @Test
    void testSetCellsAndPropagate() {
        put("A1", "5");
        ResponseEntity<Map> b1 = put("B1", "=A1+3");
        assertEquals(HttpStatus.OK, b1.getStatusCode());
        assertEquals("8", b1.getBody().get("displayValue"));
        assertEquals("=A1+3", b1.getBody().get("rawInput"));
        assertFalse(b1.getBody().containsKey("errorState"));

        put("C1", "=B1*2");
        put("A1", "10");

        ResponseEntity<Map> grid = restTemplate.getForEntity(url("/grid"), Map.class);
        assertEquals(HttpStatus.OK, grid.getStatusCode());
        assertEquals("10", grid.getBody().get("A1"));
        assertEquals("13", grid.getBody().get("B1"));
        assertEquals("26", grid.getBody().get("C1"));
        assertEquals(3, grid.getBody().size());
    }

    /**
     * A broken formula is still a successful request; the cell carries the error.
     */
    @Test
    void testFormulaErrorsAreCellState() {
        ResponseEntity<Map> response = put("A1", "=5/0");
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals("#ERROR", response.getBody().get("displayValue"));
        assertEquals("Invalid result", response.getBody().get("errorState"));

        put("B1", "=B1");
        ResponseEntity<Map> b1 = restTemplate.getForEntity(url("/grid/cells/B1"), Map.class);
        assertEquals("#CIRCULAR", b1.getBody().get("displayValue"));
        assertEquals("Circular reference detected", b1.getBody().get("errorState"));
    }

    @Test
    void testInvalidCellId() {
        HttpClientErrorException ex = assertThrows(HttpClientErrorException.class,
                () -> put("K1", "5"));
        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        assertTrue(ex.getResponseBodyAsString().contains("INVALID_CELL_ID"));

        assertThrows(HttpClientErrorException.class,
                () -> restTemplate.getForEntity(url("/grid/cells/A11"), Map.class));
    }

    @Test
    void testGetAllCells() {
        put("J10", "last");

        ResponseEntity<List> response = restTemplate.getForEntity(url("/grid/cells"), List.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        List<?> cells = response.getBody();
        assertEquals(100, cells.size());
        assertEquals("A1", ((Map<?, ?>) cells.get(0)).get("id"));
        Map<?, ?> last = (Map<?, ?>) cells.get(99);
        assertEquals("J10", last.get("id"));
        assertEquals("last", last.get("displayValue"));
    }

    @Test
    void testDependencyGraphs() {
        put("A1", "1");
        put("B1", "2");
        put("C1", "=A1+B1");

        ResponseEntity<Map> forward = restTemplate.getForEntity(url("/grid/forwardDependencies"), Map.class);
        assertEquals(List.of("C1"), forward.getBody().get("A1"));
        assertEquals(List.of("C1"), forward.getBody().get("B1"));

        ResponseEntity<Map> reverse = restTemplate.getForEntity(url("/grid/reverseDependencies"), Map.class);
        assertEquals(List.of("A1", "B1"), reverse.getBody().get("C1"));

        ResponseEntity<List> precedents = restTemplate.getForEntity(url("/grid/cells/C1/precedents"), List.class);
        assertEquals(List.of("A1", "B1"), precedents.getBody());

        put("C1", "=A1");
        ResponseEntity<List> dependents = restTemplate.getForEntity(url("/grid/cells/B1/dependents"), List.class);
        assertTrue(dependents.getBody().isEmpty());
    }

    @Test
    void testEmptyBodyClearsCell() {
        put("A1", "5");
        put("A1", "");

        ResponseEntity<Map> grid = restTemplate.getForEntity(url("/grid"), Map.class);
        assertFalse(grid.getBody().containsKey("A1"));
    }

    private ResponseEntity<Map> put(String cellId, String rawInput) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.TEXT_PLAIN);
        HttpEntity<String> request = new HttpEntity<>(rawInput, headers);
        return restTemplate.exchange(url("/grid/cells/" + cellId), HttpMethod.PUT, request, Map.class);
    }

    private String url(String path) {
        return "http://localhost:" + port + path;
    }
}
