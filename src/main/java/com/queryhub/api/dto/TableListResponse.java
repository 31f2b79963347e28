package com.queryhub.api.dto;

import com.queryhub.domain.model.TableInfo;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TableListResponse {

    private List<TableInfo> tables;
}
