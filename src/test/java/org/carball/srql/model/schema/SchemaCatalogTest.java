package org.carball.srql.model.schema;

import org.carball.srql.TestSchemas;
import org.carball.srql.error.ErrorKind;
import org.carball.srql.error.UnknownEntityException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SchemaCatalogTest {

    @Test
    void shouldResolveNamesAndAliasesCaseInsensitively() throws Exception {
        // Given
        SchemaCatalog catalog = TestSchemas.catalog();

        // Then
        assertThat(catalog.resolve("LOGS")).isSameAs(TestSchemas.LOGS);
        assertThat(catalog.resolve("log")).isSameAs(TestSchemas.LOGS);
        assertThat(catalog.find(" Cpu_Metrics ")).contains(TestSchemas.CPU_METRICS);
    }

    @Test
    void shouldReportUnknownEntity() {
        assertThatThrownBy(() -> TestSchemas.catalog().resolve("widgets"))
                .isInstanceOf(UnknownEntityException.class)
                .extracting("kind").isEqualTo(ErrorKind.UNKNOWN_ENTITY);
    }

    @Test
    void shouldRejectDuplicateEntities() {
        assertThatThrownBy(() -> SchemaCatalog.of(List.of(TestSchemas.LOGS, TestSchemas.LOGS)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("defined twice");
    }

    @Test
    void shouldRejectAliasSharedByTwoEntities() {
        // Given
        EntitySchema other = TestSchemas.ITEMS.toBuilder().alias("log").build();

        // Then
        assertThatThrownBy(() -> SchemaCatalog.of(List.of(TestSchemas.LOGS, other)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Alias 'log'");
    }

    @Test
    void shouldRejectSchemaReferencingUnknownColumns() {
        // Given
        EntitySchema broken = TestSchemas.ITEMS.toBuilder().tieBreakColumn("uuid").build();

        // Then
        assertThatThrownBy(() -> SchemaCatalog.of(List.of(broken)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("tie-break column 'uuid'");
    }
}
