package com.onalog.discovery.lead.dedupe;

import com.onalog.discovery.lead.model.DuplicateCheckResult;
import com.onalog.discovery.lead.persistence.LeadRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DuplicateDetectorTest {

    @Mock
    private LeadRepository leadRepository;

    @InjectMocks
    private DuplicateDetector detector;

    @Test
    void sameHostInSameJobIsWebsiteDuplicate() {
        when(leadRepository.findNonDuplicateIdByHost(7L, "acme.com")).thenReturn(11L);
        when(leadRepository.existsNonDuplicate(11L, 7L)).thenReturn(true);

        DuplicateCheckResult result = detector.detect("https://www.acme.com/about", "Acme", 7L);

        assertThat(result.duplicate()).isTrue();
        assertThat(result.duplicateOfLeadId()).isEqualTo(11L);
        assertThat(result.matchType()).isEqualTo(DuplicateCheckResult.MATCH_WEBSITE);
    }

    @Test
    void similarNameInSameJobIsNameDuplicate() {
        when(leadRepository.findNonDuplicateIdByHost(7L, "acmecorp.io")).thenReturn(null);
        when(leadRepository.findNonDuplicateNames(7L)).thenReturn(List.of(
            new LeadRepository.LeadName(3L, "Bravo Foods"),
            new LeadRepository.LeadName(4L, "Acme Corp")
        ));
        when(leadRepository.existsNonDuplicate(4L, 7L)).thenReturn(true);

        DuplicateCheckResult result = detector.detect("https://acmecorp.io", "Acme Corporation", 7L);

        assertThat(result.duplicate()).isTrue();
        assertThat(result.duplicateOfLeadId()).isEqualTo(4L);
        assertThat(result.matchType()).isEqualTo(DuplicateCheckResult.MATCH_NAME);
    }

    @Test
    void placeholderLinksSkipHostLookupButStillCompareNames() {
        when(leadRepository.findNonDuplicateNames(7L)).thenReturn(List.of(new LeadRepository.LeadName(4L, "Blue Bottle Cafe")));
        when(leadRepository.existsNonDuplicate(4L, 7L)).thenReturn(true);

        DuplicateCheckResult result = detector.detect("places:abc", "Blue Bottle Cafe", 7L);

        assertThat(result.duplicate()).isTrue();
        verify(leadRepository, never()).findNonDuplicateIdByHost(anyLong(), anyString());
    }

    @Test
    void hostSeenOnlyInOtherJobsIsUnique() {
        when(leadRepository.findNonDuplicateIdByHost(7L, "acme.com")).thenReturn(null);
        when(leadRepository.findNonDuplicateNames(7L)).thenReturn(List.of());
        when(leadRepository.countOtherJobsWithHost(7L, "acme.com")).thenReturn(2);

        DuplicateCheckResult result = detector.detect("https://acme.com", "Acme", 7L);

        assertThat(result.duplicate()).isFalse();
        assertThat(detector.crossJobMatches("https://acme.com", 7L)).isEqualTo(2);
    }

    @Test
    void vanishedTargetTriggersRescan() {
        when(leadRepository.findNonDuplicateIdByHost(eq(7L), eq("acme.com"))).thenReturn(11L, (Long) null);
        when(leadRepository.existsNonDuplicate(11L, 7L)).thenReturn(false);
        when(leadRepository.findNonDuplicateNames(7L)).thenReturn(List.of());

        DuplicateCheckResult result = detector.detect("https://acme.com", "Acme", 7L);

        assertThat(result.duplicate()).isFalse();
    }

    @Test
    void shortNamesAreNotComparedByName() {
        when(leadRepository.findNonDuplicateIdByHost(7L, "ab.com")).thenReturn(null);

        DuplicateCheckResult result = detector.detect("https://ab.com", "AB", 7L);

        assertThat(result.duplicate()).isFalse();
        verify(leadRepository, never()).findNonDuplicateNames(anyLong());
    }
}
