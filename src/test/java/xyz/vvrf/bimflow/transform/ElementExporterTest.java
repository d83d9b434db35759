package xyz.vvrf.bimflow.transform;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import xyz.vvrf.bimflow.model.BimElement;
import xyz.vvrf.bimflow.test.util.BimFixtures;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ElementExporterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ElementExporter exporter = new ElementExporter(objectMapper);
    private final List<BimElement> walls = BimFixtures.building().subList(0, 3);

    @Test
    void shouldExportSelectedColumnsAsCsv() {
        String csv = exporter.export(Arrays.asList(walls.get(0), walls.get(2)), "csv", "Name, Material");

        assertThat(csv).isEqualTo("Name,Material\nWall-01,Concrete\nWall-03,Brick\n");
    }

    @Test
    void shouldQuoteCsvValuesWithSeparators() {
        BimElement curved = BimFixtures.element("c", 1, "IFCWALL", "Wall, \"curved\"");

        assertThat(exporter.export(Collections.singletonList(curved), "csv", "Name,Missing"))
                .isEqualTo("Name,Missing\n\"Wall, \"\"curved\"\"\",\n");
    }

    @Test
    void shouldExportJsonWithOnlyExistingPaths() throws Exception {
        String json = exporter.export(walls, "json", "Name,Pset_WallCommon.FireRating,Missing");

        List<Map<String, Object>> rows = objectMapper.readValue(json, new TypeReference<List<Map<String, Object>>>() { });
        assertThat(rows).hasSize(3);
        assertThat(rows.get(0))
                .containsEntry("Name", "Wall-01")
                .containsEntry("Pset_WallCommon.FireRating", "REI60")
                .doesNotContainKey("Missing");
        assertThat(json).contains("\n");
    }

    @Test
    void shouldUseFirstElementPropertiesWhenNoColumnsGiven() {
        String csv = exporter.export(walls, "csv", " ");

        assertThat(csv).startsWith("Name,Material,BuildingStorey\n");
    }

    @Test
    void shouldExportEmptyRowsWhenFirstElementHasNoPropertiesAndNoColumnsGiven() throws Exception {
        BimElement bare = BimFixtures.element("bare", 9, "IFCPROXY", "Bare");
        bare.setProperties(null);

        String json = exporter.export(Arrays.asList(bare, walls.get(0)), "json", "");
        List<Map<String, Object>> rows = objectMapper.readValue(json, new TypeReference<List<Map<String, Object>>>() { });
        assertThat(rows).hasSize(2);
        assertThat(rows.get(0)).isEmpty();
        assertThat(rows.get(1)).isEmpty();
        assertThat(exporter.export(Collections.singletonList(bare), "csv", null)).isEqualTo("\n\n");
    }

    @Test
    void shouldHandleEmptyInputAndRejectUnknownFormat() {
        assertThat(exporter.export(Collections.emptyList(), "json", null)).isEqualTo("[]");
        assertThat(exporter.export(Collections.emptyList(), "csv", null)).isEmpty();
        assertThatThrownBy(() -> exporter.export(walls, "ifc", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ifc");
    }
}
