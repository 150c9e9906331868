package com.pgwire.postgresprotocol.model.protocol;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of CopyInResponse and CopyOutResponse.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CopyInResponse {
    private byte overallFormat;
    private List<Short> columnFormatCodes;
}
