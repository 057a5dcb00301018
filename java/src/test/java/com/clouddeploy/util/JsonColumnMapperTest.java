package com.clouddeploy.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for JsonColumnMapper.
 */
class JsonColumnMapperTest {

    private final JsonColumnMapper mapper = new JsonColumnMapper(new ObjectMapper());

    @Test
    void readObjectMap_KeepsNestedValues() {
        Map<String, Object> config = mapper.readObjectMap("{\"repo_url\":\"https://github.com/a/b\",\"depth\":1}");

        assertThat(config).containsEntry("repo_url", "https://github.com/a/b").containsEntry("depth", 1);
    }

    @Test
    void read_EmptyOrBrokenColumnGivesEmptyMap() {
        assertThat(mapper.readStringMap(null)).isEmpty();
        assertThat(mapper.readStringMap("")).isEmpty();
        assertThat(mapper.readStringMap("{not json")).isEmpty();
    }

    @Test
    void write_NullStaysNull() {
        assertThat(mapper.write(null)).isNull();
        assertThat(mapper.write(Map.of("MODE", "prod"))).isEqualTo("{\"MODE\":\"prod\"}");
    }
}
