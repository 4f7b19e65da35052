package com.taskaggregator.trigger.http;

import com.taskaggregator.api.dto.ServerStatusDTO;
import com.taskaggregator.api.response.Response;
import com.taskaggregator.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 存活探测
 */
@RestController
public class ServerStatusController {

    static final String RUNNING = "Server is running";

    @GetMapping("/status")
    public Response<ServerStatusDTO> status() {
        return Response.<ServerStatusDTO>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(new ServerStatusDTO(RUNNING))
                .build();
    }
}
