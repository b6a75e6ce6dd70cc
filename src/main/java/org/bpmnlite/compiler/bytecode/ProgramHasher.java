package org.bpmnlite.compiler.bytecode;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.bpmnlite.compiler.bytecode.models.ErrorRoute;
import org.bpmnlite.compiler.bytecode.models.Instr;
import org.bpmnlite.compiler.bytecode.models.JoinPlanEntry;
import org.bpmnlite.compiler.bytecode.models.RaceEntry;
import org.bpmnlite.compiler.bytecode.models.WaitPlanEntry;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.SortedMap;

/**
 * Computes the content-addressed program version: SHA-256 over a canonical JSON rendering
 * (properties and map keys sorted) of everything the runtime executes.
 * The debug map is left out, it carries no semantics.
 */
public class ProgramHasher {

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .build();

    record HashedContent(
            List<Instr> instructions,
            List<String> taskManifest,
            SortedMap<String, String> boundaryMap,
            SortedMap<String, RaceEntry> racePlan,
            SortedMap<Integer, JoinPlanEntry> joinPlan,
            SortedMap<Integer, WaitPlanEntry> waitPlan,
            SortedMap<String, List<ErrorRoute>> errorRoutes
    ) {
    }

    static String hash(HashedContent content) {
        byte[] canonical;
        try {
            canonical = CANONICAL.writeValueAsString(content).getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Program content cannot be serialized for hashing", e);
        }
        return sha256Hex(canonical);
    }

    static String sha256Hex(byte[] data) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
