package com.arganhr.adminauth.auth.api.mapper;

import com.arganhr.adminauth.auth.api.dto.AdminProfileResponse;
import com.arganhr.adminauth.auth.api.dto.SessionResponse;
import com.arganhr.adminauth.auth.service.AdminCredential;
import com.arganhr.adminauth.auth.service.Session;
import org.mapstruct.Mapper;

@Mapper(componentModel = "spring")
public interface AdminAuthApiMapper {
  AdminProfileResponse toProfile(AdminCredential admin);

  SessionResponse toSessionResponse(Session session);
}
