package com.example.cronhooks.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Page;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PagedResponse<T> {
    private List<T> data;
    private long total;
    private int page;
    private int pageSize;

    public static <T> PagedResponse<T> of(Page<T> p) {
        return new PagedResponse<>(p.getContent(), p.getTotalElements(), p.getNumber() + 1, p.getSize());
    }
}
