package feed.reader.app.dto;

import lombok.Data;

@Data
public class NameRequest {
    private String name;
}
