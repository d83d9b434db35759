package xyz.vvrf.bimflow.transform;

import org.junit.jupiter.api.Test;
import xyz.vvrf.bimflow.model.BimElement;
import xyz.vvrf.bimflow.test.util.BimFixtures;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RelationshipQueriesTest {

    private final List<BimElement> building = BimFixtures.building();

    @Test
    void shouldReturnElementsDeclaringRelationForOutgoing() {
        assertThat(RelationshipQueries.query(building, "voiding", "outgoing"))
                .extracting(BimElement::getId)
                .containsExactly("d1");
    }

    @Test
    void shouldReturnReferencedElementsForIncoming() {
        assertThat(RelationshipQueries.query(building, "voiding", RelationshipQueries.INCOMING))
                .extracting(BimElement::getId)
                .containsExactly("o1");
    }

    @Test
    void shouldFallBackToContainmentForUnknownType() {
        building.get(4).getRelations().put(RelationshipQueries.CONTAINMENT, java.util.Collections.singletonList("w1"));

        assertThat(RelationshipQueries.normalizeRelationType("hosting")).isEqualTo(RelationshipQueries.CONTAINMENT);
        assertThat(RelationshipQueries.query(building, "hosting", RelationshipQueries.INCOMING))
                .extracting(BimElement::getId)
                .containsExactly("w1");
    }
}
