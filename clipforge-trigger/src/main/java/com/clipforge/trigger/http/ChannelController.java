package com.clipforge.trigger.http;

import com.clipforge.api.dto.ChannelStatusDTO;
import com.clipforge.api.response.Response;
import com.clipforge.trigger.application.command.ChannelAdminCommandService;
import com.clipforge.trigger.application.query.ChannelStatusQueryService;
import com.clipforge.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 渠道状态查询与停用 API。
 */
@RestController
@RequestMapping("/api/channels")
public class ChannelController {

    private final ChannelStatusQueryService channelStatusQueryService;
    private final ChannelAdminCommandService channelAdminCommandService;

    public ChannelController(ChannelStatusQueryService channelStatusQueryService,
                             ChannelAdminCommandService channelAdminCommandService) {
        this.channelStatusQueryService = channelStatusQueryService;
        this.channelAdminCommandService = channelAdminCommandService;
    }

    @GetMapping("/status")
    public Response<List<ChannelStatusDTO>> listStatuses() {
        return success(channelStatusQueryService.listStatuses());
    }

    @GetMapping("/{id}/status")
    public Response<ChannelStatusDTO> getStatus(@PathVariable("id") Long channelId) {
        return success(channelStatusQueryService.getStatus(channelId));
    }

    @PostMapping("/{id}/disable")
    public Response<ChannelStatusDTO> disable(@PathVariable("id") Long channelId) {
        channelAdminCommandService.disableChannel(channelId);
        return success(channelStatusQueryService.getStatus(channelId));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
