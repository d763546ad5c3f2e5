package io.b2mash.filegate.security;

import java.util.ArrayList;
import java.util.List;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

/** Authenticated request carrying an {@link Uploader} principal. */
public class UploaderAuthentication extends AbstractAuthenticationToken {

  private final Uploader uploader;

  public UploaderAuthentication(Uploader uploader) {
    super(authoritiesOf(uploader));
    this.uploader = uploader;
    setAuthenticated(true);
  }

  @Override
  public Object getCredentials() {
    return null;
  }

  @Override
  public Uploader getPrincipal() {
    return uploader;
  }

  @Override
  public String getName() {
    return uploader.creatorTag();
  }

  static List<GrantedAuthority> authoritiesOf(Uploader uploader) {
    var authorities = new ArrayList<GrantedAuthority>();
    if (uploader.isAdmin()) {
      authorities.add(new SimpleGrantedAuthority(Authorities.ADMIN));
      authorities.add(new SimpleGrantedAuthority(Authorities.PERM_FILE));
      authorities.add(new SimpleGrantedAuthority(Authorities.PERM_TEXT));
      authorities.add(new SimpleGrantedAuthority(Authorities.PERM_MOUNT));
      return authorities;
    }
    authorities.add(new SimpleGrantedAuthority(Authorities.API_KEY));
    var scope = uploader.effectiveScope();
    if (scope.filePermission()) {
      authorities.add(new SimpleGrantedAuthority(Authorities.PERM_FILE));
    }
    if (scope.textPermission()) {
      authorities.add(new SimpleGrantedAuthority(Authorities.PERM_TEXT));
    }
    if (scope.mountPermission()) {
      authorities.add(new SimpleGrantedAuthority(Authorities.PERM_MOUNT));
    }
    return authorities;
  }
}
