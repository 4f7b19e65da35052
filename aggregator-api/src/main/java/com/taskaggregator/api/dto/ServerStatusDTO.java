package com.taskaggregator.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 服务状态 DTO。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ServerStatusDTO {

    private String status;
}
