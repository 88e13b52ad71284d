package me.golemcore.memoria.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.memoria.domain.model.Message;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetrieveRequest {
    private String query;
    @Builder.Default
    private List<Message> history = new ArrayList<>();
}
