/* (C)2026 */
package com.ammann.coursecorrect.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ammann.coursecorrect.dto.CorrectionRunDTO;
import com.ammann.coursecorrect.dto.CorrectionTableDTO;
import com.ammann.coursecorrect.enumeration.JobStatus;
import com.ammann.coursecorrect.exception.CorrectionTableUnavailableException;
import com.ammann.coursecorrect.model.CorrectionRun;
import com.ammann.coursecorrect.properties.ApiProperties;
import com.ammann.coursecorrect.service.CorrectionRecomputationService;
import com.ammann.coursecorrect.service.CorrectionTableRegistry;
import com.ammann.coursecorrect.support.TestDataFactory;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.core.Response;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CorrectionResourceTest {

    private CorrectionResource resource;
    private CorrectionRecomputationService recomputationService;

    @BeforeEach
    void setUp() {
        recomputationService = mock(CorrectionRecomputationService.class);
        resource = new CorrectionResource();
        resource.registry = new CorrectionTableRegistry();
        resource.recomputationService = recomputationService;
    }

    // =========================================================================
    // Annotations / path
    // =========================================================================

    @Test
    void resource_classHasCorrectPath() {
        Path path = CorrectionResource.class.getAnnotation(Path.class);
        assertThat(path.value()).isEqualTo(ApiProperties.BASE_URL_V1 + ApiProperties.Corrections.BASE);
    }

    @Test
    void recomputeEndpoint_isPost() throws NoSuchMethodException {
        var method = CorrectionResource.class.getMethod("recompute", String.class);
        assertThat(method.getAnnotation(POST.class)).isNotNull();
        assertThat(method.getAnnotation(Path.class).value()).isEqualTo(ApiProperties.Corrections.RECOMPUTE);
    }

    // =========================================================================
    // Table
    // =========================================================================

    @Test
    void getCorrections_returnsPublishedTable() {
        resource.registry.publish(TestDataFactory.referenceTable(3L));

        Response response = resource.getCorrections();

        CorrectionTableDTO body = (CorrectionTableDTO) response.getEntity();
        assertThat(body.runId()).isEqualTo(3L);
        assertThat(body.baselineVenue()).isEqualTo("Maastricht");
        assertThat(body.baselineMedianMen()).isEqualTo(4800.0);
        assertThat(body.entries()).hasSize(7);
    }

    @Test
    void getCorrections_withoutTableIsUnavailable() {
        assertThatThrownBy(resource::getCorrections).isInstanceOf(CorrectionTableUnavailableException.class);
    }

    // =========================================================================
    // Runs
    // =========================================================================

    @Test
    void getRecentRuns_capsLimitAt50() {
        when(recomputationService.getRecentRuns(50)).thenReturn(List.of());

        resource.getRecentRuns(500);

        verify(recomputationService).getRecentRuns(50);
    }

    @Test
    void getRecentRuns_raisesNonPositiveLimitTo1() {
        when(recomputationService.getRecentRuns(1)).thenReturn(List.of());

        resource.getRecentRuns(0);

        verify(recomputationService).getRecentRuns(1);
    }

    @Test
    void recompute_returnsRunDto() {
        CorrectionRun run = TestDataFactory.run(JobStatus.COMPLETED, Instant.now());
        run.id = 9L;
        when(recomputationService.recompute("London")).thenReturn(run);

        Response response = resource.recompute("London");

        CorrectionRunDTO body = (CorrectionRunDTO) response.getEntity();
        assertThat(body.status()).isEqualTo("COMPLETED");
        assertThat(body.baselineVenue()).isEqualTo("Maastricht");
    }
}
