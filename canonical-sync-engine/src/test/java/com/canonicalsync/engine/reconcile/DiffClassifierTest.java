package com.canonicalsync.engine.reconcile;

import com.canonicalsync.core.model.DiffStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class DiffClassifierTest {

    private final DiffClassifier classifier = new DiffClassifier();

    @Test
    @DisplayName("Equal git hashes are unchanged regardless of runtime drift")
    void testUnchanged() {
        assertThat(classifier.classify(DiffInputs.of("A", "A", "B", "C"))).isEqualTo(DiffStatus.UNCHANGED);
    }

    @Test
    @DisplayName("Target-only and added")
    void testPresenceOnOneSide() {
        assertThat(classifier.classify(DiffInputs.of(null, "A", null, null))).isEqualTo(DiffStatus.TARGET_ONLY);
        assertThat(classifier.classify(DiffInputs.of("A", null, null, null))).isEqualTo(DiffStatus.ADDED);
        assertThat(classifier.classify(DiffInputs.of("A", null, "B", null))).isEqualTo(DiffStatus.ADDED);
    }

    @Test
    @DisplayName("Source runtime drift with diverged target git is a conflict")
    void testConflict() {
        assertThat(classifier.classify(DiffInputs.of("A", "B", "C", null))).isEqualTo(DiffStatus.CONFLICT);
    }

    @Test
    @DisplayName("Conflict wins over target hotfix")
    void testConflictPriorityOverHotfix() {
        assertThat(classifier.classify(DiffInputs.of("A", "B", "C", "A"))).isEqualTo(DiffStatus.CONFLICT);
    }

    @Test
    @DisplayName("Target runtime already carrying the source git content is a hotfix")
    void testTargetHotfix() {
        assertThat(classifier.classify(DiffInputs.of("A", "B", "A", "A"))).isEqualTo(DiffStatus.TARGET_HOTFIX);
        assertThat(classifier.classify(DiffInputs.of("A", "B", null, "A"))).isEqualTo(DiffStatus.TARGET_HOTFIX);
    }

    @Test
    @DisplayName("Otherwise modified")
    void testModified() {
        assertThat(classifier.classify(DiffInputs.of("A", "B", null, null))).isEqualTo(DiffStatus.MODIFIED);
        assertThat(classifier.classify(DiffInputs.of("A", "B", "A", "B"))).isEqualTo(DiffStatus.MODIFIED);
    }

    @Test
    @DisplayName("Runtime-authoritative source promotes its runtime content")
    void testRuntimeAuthoritativeSource() {
        DiffInputs inputs = new DiffInputs("H1", "H1", "H2", "H1", true);

        assertThat(inputs.promotableSourceHash()).isEqualTo("H2");
        assertThat(classifier.classify(inputs)).isEqualTo(DiffStatus.MODIFIED);
    }

    @Test
    @DisplayName("Runtime-authoritative source still reports a conflict against raw git hashes")
    void testRuntimeAuthoritativeConflict() {
        assertThat(classifier.classify(new DiffInputs("A", "B", "C", null, true))).isEqualTo(DiffStatus.CONFLICT);
        assertThat(classifier.classify(new DiffInputs("A", "B", "C", "C", true))).isEqualTo(DiffStatus.CONFLICT);
    }

    @Test
    @DisplayName("Runtime-authoritative source without git state is target-only")
    void testRuntimeAuthoritativeTargetOnly() {
        assertThat(classifier.classify(new DiffInputs(null, "B", "C", null, true))).isEqualTo(DiffStatus.TARGET_ONLY);
        assertThat(classifier.classify(new DiffInputs(null, null, "C", null, true))).isEqualTo(DiffStatus.UNCHANGED);
    }

    @Test
    @DisplayName("Runtime-authoritative source whose runtime content already reached target git is unchanged")
    void testRuntimeAuthoritativeAlreadyPromoted() {
        assertThat(classifier.classify(new DiffInputs("H1", "H2", "H2", null, true))).isEqualTo(DiffStatus.UNCHANGED);
        assertThat(classifier.classify(new DiffInputs("H1", "H1", "H2", "H2", true))).isEqualTo(DiffStatus.TARGET_HOTFIX);
    }

    @Test
    @DisplayName("Every combination of present, absent, equal and differing hashes yields exactly one status")
    void testExhaustiveCombinations() {
        String[] values = {null, "A", "B", "C"};

        for (boolean sourceRuntimeAuthoritative : new boolean[] {false, true}) {
            Set<DiffStatus> seen = EnumSet.noneOf(DiffStatus.class);

            for (String sourceGit : values) {
                for (String targetGit : values) {
                    for (String sourceEnv : values) {
                        for (String targetEnv : values) {
                            DiffInputs inputs = new DiffInputs(sourceGit, targetGit, sourceEnv, targetEnv,
                                sourceRuntimeAuthoritative);
                            DiffStatus status = classifier.classify(inputs);
                            String description = String.format("inputs %s/%s/%s/%s authoritative=%s",
                                sourceGit, targetGit, sourceEnv, targetEnv, sourceRuntimeAuthoritative);

                            assertThat(status).as(description).isNotNull();
                            assertThat(Arrays.asList(DiffStatus.values())).contains(status);
                            seen.add(status);

                            boolean promoted = Objects.equals(inputs.promotableSourceHash(), targetGit);
                            boolean conflictPrecondition = sourceGit != null && targetGit != null
                                && !sourceGit.equals(targetGit)
                                && sourceEnv != null && !sourceEnv.equals(sourceGit);
                            if (conflictPrecondition && !promoted) {
                                assertThat(status).as(description).isEqualTo(DiffStatus.CONFLICT);
                            }
                            if (status == DiffStatus.CONFLICT) {
                                assertThat(conflictPrecondition).as(description).isTrue();
                            }
                            if (promoted || (sourceGit == null && targetGit == null)) {
                                assertThat(status).as(description).isEqualTo(DiffStatus.UNCHANGED);
                            }
                            if (sourceGit == null && targetGit != null && !promoted) {
                                assertThat(status).as(description).isEqualTo(DiffStatus.TARGET_ONLY);
                            }
                        }
                    }
                }
            }

            assertThat(seen).as("authoritative=%s", sourceRuntimeAuthoritative)
                .containsExactlyInAnyOrder(DiffStatus.values());
        }
    }
}
