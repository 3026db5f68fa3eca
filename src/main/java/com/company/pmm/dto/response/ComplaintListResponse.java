package com.company.pmm.dto.response;

import com.company.pmm.domain.Complaint;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ComplaintListResponse {
    private int count;
    private List<Complaint> complaints;

    public static ComplaintListResponse of(List<Complaint> complaints) {
        return new ComplaintListResponse(complaints.size(), complaints);
    }
}
