package com.inventoryforecast.search;

import com.inventoryforecast.client.ArimaLibrary;
import com.inventoryforecast.exception.ModelFitException;
import com.inventoryforecast.model.ArimaConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GridSearchOrderSelectionTest {

    private static final double[] VALUES = {10, 12, 11, 13, 12, 14, 13, 15, 14, 16};
    private static final OrderSearchContext NON_SEASONAL = new OrderSearchContext(false, 7);

    @Mock
    private ArimaLibrary arimaLibrary;

    @InjectMocks
    private GridSearchOrderSelection selection;

    @Test
    void candidates_nonSeasonal_coversEighteenOrders() {
        assertThat(selection.candidates(NON_SEASONAL))
            .hasSize(18)
            .allMatch(c -> !c.isSeasonal())
            .startsWith(ArimaConfig.of(0, 0, 0));
    }

    @Test
    void candidates_seasonal_addsTwoSeasonalVariantsPerOrder() {
        assertThat(selection.candidates(new OrderSearchContext(true, 7)))
            .hasSize(54)
            .filteredOn(ArimaConfig::isSeasonal)
            .hasSize(36)
            .allMatch(c -> c.seasonal().period() == 7);
    }

    @Test
    void select_picksLowestAic() {
        when(arimaLibrary.fit(any(), any())).thenAnswer(inv -> {
            ArimaConfig c = inv.getArgument(1);
            return new StubArima(c, Math.abs(c.p() - 1) + Math.abs(c.q() - 2) + c.d() + 100.0);
        });

        SelectionAttempt attempt = selection.select(VALUES, NON_SEASONAL);

        assertThat(attempt.isSuccess()).isTrue();
        assertThat(attempt.method()).isEqualTo(GridSearchOrderSelection.METHOD);
        assertThat(attempt.fallback()).isFalse();
        assertThat(attempt.candidatesEvaluated()).isEqualTo(18);
        assertThat(attempt.model().config()).isEqualTo(ArimaConfig.of(1, 0, 2));
    }

    @Test
    void select_skipsFailedAndNonFiniteCandidates() {
        when(arimaLibrary.fit(any(), any())).thenAnswer(inv -> {
            ArimaConfig c = inv.getArgument(1);
            if (c.p() == 0) {
                throw new ModelFitException("singular");
            }
            if (c.p() == 1) {
                return new StubArima(c, Double.NaN);
            }
            return new StubArima(c, 50.0 + c.q() + c.d());
        });

        SelectionAttempt attempt = selection.select(VALUES, NON_SEASONAL);

        assertThat(attempt.model().config()).isEqualTo(ArimaConfig.of(2, 0, 0));
    }

    @Test
    void select_everyCandidateFails_returnsFailedAttempt() {
        when(arimaLibrary.fit(any(), any())).thenThrow(new ModelFitException("no convergence"));

        SelectionAttempt attempt = selection.select(VALUES, NON_SEASONAL);

        assertThat(attempt.isSuccess()).isFalse();
        assertThat(attempt.candidatesEvaluated()).isEqualTo(18);
        assertThat(attempt.error()).isNotBlank();
        verify(arimaLibrary, times(18)).fit(any(), any());
    }
}
