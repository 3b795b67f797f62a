package com.clipforge.trigger.http;

import com.clipforge.api.response.Response;
import com.clipforge.trigger.application.command.ChannelAdminCommandService;
import com.clipforge.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/products")
public class ProductController {

    private final ChannelAdminCommandService channelAdminCommandService;

    public ProductController(ChannelAdminCommandService channelAdminCommandService) {
        this.channelAdminCommandService = channelAdminCommandService;
    }

    @PostMapping("/{id}/analysis/invalidate")
    public Response<Map<String, Object>> invalidateAnalysis(@PathVariable("id") Long productId) {
        boolean cleared = channelAdminCommandService.invalidateAnalysis(productId);
        return Response.<Map<String, Object>>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(Map.of("productId", productId, "cleared", cleared))
                .build();
    }
}
