package dk.trustworks.attribution.aggregates.attribution.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatrixCellDTO {
    private int customerCount;
    private double winRate;
    private double averageDealSize;
    private double totalCost;
    private double closedWonValue;
    private double roi;
}
