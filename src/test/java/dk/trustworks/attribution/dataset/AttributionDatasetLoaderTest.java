package dk.trustworks.attribution.dataset;

import dk.trustworks.attribution.exceptions.DataUnavailableException;
import dk.trustworks.attribution.model.Campaign;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Set;

import static dk.trustworks.attribution.utils.TestDataBuilders.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("AttributionDatasetLoader Tests")
class AttributionDatasetLoaderTest {

    @InjectMocks
    private AttributionDatasetLoader loader;

    @Mock
    private AttributionDataSource dataSource;

    @Test
    @DisplayName("load - campaigns outside the filter are dropped together with their touches")
    void testLoad_FiltersCampaigns() {
        // Arrange
        when(dataSource.getCampaigns(null)).thenReturn(List.of(
                campaign(1, "Webinar", 100.0, day(0)),
                campaign(2, "Event", 100.0, day(0)),
                campaign(3, "Email", 100.0, day(0))));
        when(dataSource.getTouches(Set.of(1L, 2L, 3L))).thenReturn(List.of(
                touch(1, 10, 2, day(0)),
                touch(3, 10, 1, day(0))));
        when(dataSource.getOpportunities()).thenReturn(List.of(opportunity(10, "Acme", true)));
        when(dataSource.getAllSnapshots()).thenReturn(List.of(
                snapshot(10, day(1), "Discovery", 100.0, day(1), null)));

        // Act
        AttributionDataset data = loader.load(new CampaignFilter(Set.of("Webinar", "Event"), null, null));

        // Assert
        assertEquals(List.of(1L, 2L), data.campaigns().stream().map(Campaign::id).toList());
        assertEquals(1, data.touches().size());
        assertEquals(1L, data.touches().get(0).campaignId());
        assertTrue(data.latestSnapshot(10L).isPresent());
    }

    @Test
    @DisplayName("load - a campaign without a type is skipped by a type filter instead of failing the load")
    void testLoad_UntypedCampaignWithTypeFilter() {
        // Arrange
        when(dataSource.getCampaigns(null)).thenReturn(List.of(
                campaign(1, "Webinar", 100.0, day(0)),
                new Campaign(2L, "untyped", null, 50.0, day(0))));
        when(dataSource.getTouches(Set.of(1L, 2L))).thenReturn(List.of());
        when(dataSource.getOpportunities()).thenReturn(List.of());
        when(dataSource.getAllSnapshots()).thenReturn(List.of());

        // Act
        AttributionDataset data = loader.load(new CampaignFilter(Set.of("Webinar", "Event"), null, null));

        // Assert
        assertEquals(List.of(1L), data.campaigns().stream().map(Campaign::id).toList());
    }

    @Test
    @DisplayName("load - selecting the unspecified type finds campaigns stored without a type")
    void testLoad_UnspecifiedTypeSelection() {
        // Arrange
        when(dataSource.getCampaigns(null)).thenReturn(List.of(
                campaign(1, "Webinar", 100.0, day(0)),
                new Campaign(2L, "untyped", " ", 50.0, day(0))));
        when(dataSource.getTouches(anySet())).thenReturn(List.of());
        when(dataSource.getOpportunities()).thenReturn(List.of());
        when(dataSource.getAllSnapshots()).thenReturn(List.of());

        // Act
        AttributionDataset data = loader.load(
                new CampaignFilter(Set.of(AttributionDataset.UNSPECIFIED_TYPE), null, null));

        // Assert
        assertEquals(1, data.campaigns().size());
        assertEquals(AttributionDataset.UNSPECIFIED_TYPE, data.campaigns().get(0).type());
        verify(dataSource, never()).getCampaigns(AttributionDataset.UNSPECIFIED_TYPE);
    }

    @Test
    @DisplayName("load - records with missing references are dropped, not fatal")
    void testLoad_DropsDanglingRecords() {
        // Arrange
        when(dataSource.getCampaigns(null)).thenReturn(List.of(campaign(1, "Webinar", 100.0, day(0))));
        when(dataSource.getTouches(Set.of(1L))).thenReturn(List.of(
                touch(1, 10, 2, day(0)),
                touch(1, 99, 2, day(0))));
        when(dataSource.getOpportunities()).thenReturn(List.of(opportunity(10, "Acme", null)));
        when(dataSource.getAllSnapshots()).thenReturn(List.of(
                snapshot(98, day(1), "Discovery", 100.0, day(1), null)));

        // Act
        AttributionDataset data = loader.load(CampaignFilter.all());

        // Assert
        assertEquals(1, data.touches().size());
        assertEquals(2, data.droppedRecords());
    }

    @Test
    @DisplayName("load - a single type is pushed down to the data source")
    void testLoad_SingleTypePushedDown() {
        // Arrange
        when(dataSource.getCampaigns("Webinar")).thenReturn(List.of(campaign(1, "Webinar", 100.0, day(0))));
        when(dataSource.getTouches(anySet())).thenReturn(List.of());
        when(dataSource.getOpportunities()).thenReturn(List.of());
        when(dataSource.getAllSnapshots()).thenReturn(List.of());

        // Act
        AttributionDataset data = loader.load(new CampaignFilter(Set.of("Webinar"), null, null));

        // Assert
        assertEquals(1, data.campaigns().size());
        verify(dataSource, never()).getCampaigns(null);
    }

    @Test
    @DisplayName("load - no matching campaigns skips the touch read")
    void testLoad_NoCampaigns() {
        // Arrange
        when(dataSource.getCampaigns(null)).thenReturn(List.of());
        when(dataSource.getOpportunities()).thenReturn(List.of());
        when(dataSource.getAllSnapshots()).thenReturn(List.of());

        // Act
        AttributionDataset data = loader.load(null);

        // Assert
        assertTrue(data.campaigns().isEmpty());
        verify(dataSource, never()).getTouches(any());
    }

    @Test
    @DisplayName("load - data source failure surfaces as DataUnavailableException")
    void testLoad_FailureIsWrapped() {
        // Arrange
        when(dataSource.getCampaigns(null)).thenReturn(List.of(campaign(1, "Webinar", 100.0, day(0))));
        when(dataSource.getTouches(anySet())).thenThrow(new IllegalStateException("connection reset"));

        // Act
        DataUnavailableException exception = assertThrows(DataUnavailableException.class,
                () -> loader.load(CampaignFilter.all()));

        // Assert
        assertInstanceOf(IllegalStateException.class, exception.getCause());
        assertTrue(exception.getMessage().contains("connection reset"));
        verify(dataSource, never()).getAllSnapshots();
    }

    @Test
    @DisplayName("load - DataUnavailableException from the source is passed through unchanged")
    void testLoad_DataUnavailablePassedThrough() {
        // Arrange
        DataUnavailableException failure = new DataUnavailableException("database down");
        when(dataSource.getCampaigns(null)).thenThrow(failure);

        // Act / Assert
        assertSame(failure, assertThrows(DataUnavailableException.class, () -> loader.load(CampaignFilter.all())));
    }
}
