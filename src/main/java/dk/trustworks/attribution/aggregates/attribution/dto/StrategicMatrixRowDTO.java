package dk.trustworks.attribution.aggregates.attribution.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StrategicMatrixRowDTO {
    private String attendeeRange;
    private MatrixCellDTO targetAccounts;
    private MatrixCellDTO nonTargetAccounts;
}
