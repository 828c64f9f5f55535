package co.fanki.grd;

import co.fanki.grd.config.DiagramScoringRunner;
import co.fanki.grd.metrics.application.GrdScoringService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Context test for the GRD engine application.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootTest
@ActiveProfiles("test")
class GrdEngineApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private GrdScoringService scoringService;

    @Test
    void whenStarting_shouldWireScoringService() {
        assertNotNull(scoringService);
        assertEquals(1.0, scoringService.score(
                "graph TD\n A[Read] --> B[Think]\n B --> C[Answer]")
                .overall(), 1e-9);
    }

    @Test
    void whenStarting_givenCliDisabled_shouldNotRegisterRunner() {
        assertTrue(context.getBeansOfType(DiagramScoringRunner.class)
                .isEmpty());
    }

}
