package com.deepknow.abis.interview.repo;

import com.deepknow.abis.interview.domain.assessment.model.Transcript;
import com.deepknow.abis.interview.domain.assessment.model.TranscriptSegment;
import com.deepknow.abis.interview.repo.mapper.TranscriptSegmentMapper;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TranscriptRepositoryImplTest {

    private final TranscriptSegmentMapper mapper = mock(TranscriptSegmentMapper.class);
    private final TranscriptRepositoryImpl repository = new TranscriptRepositoryImpl(mapper);

    @Test
    void replaceDeletesThenInserts() {
        List<TranscriptSegment> segments = List.of(TranscriptSegment.candidate("I led the migration project.", 0, 3));

        repository.replace("s-1", new Transcript(segments));

        InOrder order = inOrder(mapper);
        order.verify(mapper).deleteBySession("s-1");
        order.verify(mapper).batchInsert("s-1", segments);
    }

    @Test
    void emptyTranscriptOnlyClears() {
        repository.replace("s-1", new Transcript(Collections.emptyList()));

        verify(mapper).deleteBySession("s-1");
        verify(mapper, never()).batchInsert(any(), anyList());
    }

    @Test
    void missingTranscriptIsNull() {
        when(mapper.listBySession("s-1")).thenReturn(Collections.emptyList());

        assertThat(repository.find("s-1")).isNull();
    }
}
