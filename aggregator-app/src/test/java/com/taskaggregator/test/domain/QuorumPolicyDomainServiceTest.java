package com.taskaggregator.test.domain;

import com.taskaggregator.domain.task.model.entity.TaskResponseEntity;
import com.taskaggregator.domain.task.model.valobj.ContentQuorum;
import com.taskaggregator.domain.task.model.valobj.ParticipationQuorum;
import com.taskaggregator.domain.task.model.valobj.QuorumThreshold;
import com.taskaggregator.domain.task.service.QuorumPolicyDomainService;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class QuorumPolicyDomainServiceTest {

    private final QuorumPolicyDomainService service = new QuorumPolicyDomainService(QuorumThreshold.defaults());

    @Test
    public void shouldRequireNineOfTenOperatorsByDefault() {
        ParticipationQuorum eight = service.checkParticipation(8, 10);
        ParticipationQuorum nine = service.checkParticipation(9, 10);

        Assertions.assertEquals(9, eight.quorum());
        Assertions.assertFalse(eight.reached());
        Assertions.assertEquals(1, eight.outstanding());
        Assertions.assertTrue(nine.reached());
        Assertions.assertEquals(0, nine.outstanding());
    }

    @Test
    public void shouldRequireSingleResponseForSingleOperatorRegardlessOfThreshold() {
        for (int bps : new int[]{1, 5000, 9000, 10_000}) {
            QuorumPolicyDomainService custom = new QuorumPolicyDomainService(new QuorumThreshold(bps, 9000));
            Assertions.assertEquals(1, custom.resolveQuorum(1), "bps=" + bps);
            Assertions.assertFalse(custom.checkParticipation(0, 1).reached());
            Assertions.assertTrue(custom.checkParticipation(1, 1).reached());
        }
    }

    @Test
    public void shouldRoundQuorumUpForSmallOperatorCounts() {
        Assertions.assertEquals(3, service.resolveQuorum(3));
        Assertions.assertFalse(service.checkParticipation(2, 3).reached());
        Assertions.assertTrue(service.checkParticipation(3, 3).reached());
        Assertions.assertEquals(2, service.resolveQuorum(2));
        Assertions.assertEquals(18, service.resolveQuorum(20));
    }

    @Test
    public void shouldKeepQuorumAndReachedConsistent() {
        for (int bps : new int[]{1, 3333, 6667, 9000, 9999, 10_000}) {
            QuorumPolicyDomainService custom = new QuorumPolicyDomainService(new QuorumThreshold(bps, 9000));
            for (int n = 1; n <= 50; n++) {
                int quorum = custom.resolveQuorum(n);
                Assertions.assertTrue(quorum >= 1 && quorum <= n, "bps=" + bps + ", n=" + n);
                for (int r = 0; r <= n; r++) {
                    Assertions.assertEquals(r >= quorum, custom.checkParticipation(r, n).reached(),
                            "bps=" + bps + ", n=" + n + ", r=" + r);
                }
            }
        }
    }

    @Test
    public void shouldNeverReachParticipationWithoutOperators() {
        ParticipationQuorum result = service.checkParticipation(5, 0);
        Assertions.assertEquals(0, result.quorum());
        Assertions.assertFalse(result.reached());
    }

    @Test
    public void shouldAcceptNineIdenticalOfTen() {
        List<String> values = new ArrayList<>(Collections.nCopies(9, "42"));
        values.add("41");

        ContentQuorum result = service.checkContentValues(values);

        Assertions.assertTrue(result.reached());
        Assertions.assertEquals("42", result.leadingResponse());
        Assertions.assertEquals(9, result.leadingCount());
        Assertions.assertEquals(10, result.totalCount());
    }

    @Test
    public void shouldRejectSevenIdenticalOfTen() {
        List<String> values = new ArrayList<>(Collections.nCopies(7, "42"));
        values.addAll(Arrays.asList("1", "2", "3"));

        ContentQuorum result = service.checkContentValues(values);

        Assertions.assertFalse(result.reached());
        Assertions.assertEquals("42", result.leadingResponse());
        Assertions.assertEquals(7, result.leadingCount());
    }

    @Test
    public void shouldCompareResponsesByExactValue() {
        ContentQuorum result = service.checkContentValues(Arrays.asList("abc", "abc ", "ABC"));
        Assertions.assertEquals(1, result.leadingCount());
        Assertions.assertFalse(result.reached());
    }

    @Test
    public void shouldBreakTiesByFirstAdmittedGroup() {
        List<String> values = Arrays.asList("b", "a", "a", "b");

        ContentQuorum first = service.checkContentValues(values);
        ContentQuorum second = service.checkContentValues(values);

        Assertions.assertEquals("b", first.leadingResponse());
        Assertions.assertEquals(first, second);
        Assertions.assertFalse(first.reached());
    }

    @Test
    public void shouldKeepNullAndEmptyResponsesInSeparateGroups() {
        ContentQuorum result = service.checkContentValues(Arrays.asList(null, "", ""));

        Assertions.assertEquals("", result.leadingResponse());
        Assertions.assertEquals(2, result.leadingCount());

        ContentQuorum nullLeading = service.checkContentValues(Arrays.asList(null, null, ""));
        Assertions.assertNull(nullLeading.leadingResponse());
        Assertions.assertEquals(2, nullLeading.leadingCount());
    }

    @Test
    public void shouldEvaluateResponseEntities() {
        List<TaskResponseEntity> responses = new ArrayList<>();
        for (long operatorId = 1; operatorId <= 3; operatorId++) {
            responses.add(TaskResponseEntity.of(7L, operatorId, "route-1", "sig", 1000L));
        }
        QuorumPolicyDomainService lenient = new QuorumPolicyDomainService(new QuorumThreshold(9000, 6000));
        responses.add(TaskResponseEntity.of(7L, 4L, "route-2", "sig", 1000L));

        ContentQuorum result = lenient.checkContent(responses);

        Assertions.assertTrue(result.reached());
        Assertions.assertEquals("route-1", result.leadingResponse());
    }

    @Test
    public void shouldReturnEmptyContentQuorumForNoResponses() {
        ContentQuorum result = service.checkContent(Collections.emptyList());
        Assertions.assertFalse(result.reached());
        Assertions.assertNull(result.leadingResponse());
    }

    @Test
    public void shouldRejectThresholdOutsideBasisPointRange() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new QuorumThreshold(0, 9000));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new QuorumThreshold(9000, 10_001));
    }

    @Test
    public void shouldFallBackToDefaultThreshold() {
        QuorumPolicyDomainService fallback = new QuorumPolicyDomainService(null);
        Assertions.assertEquals(QuorumThreshold.defaults(), fallback.getThreshold());
    }
}
