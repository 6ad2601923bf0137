package com.example.datachat.service;

import com.example.datachat.model.entity.AppUser;
import com.example.datachat.repository.AppUserRepository;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Credenciales de la API de chat contra app_user. La autorizacion por proyecto no usa
 * estas authorities: la decide {@link ProjectAccessGuard} con la organizacion y el equipo.
 */
@Service
public class DbUserDetailsService implements UserDetailsService {

    private final AppUserRepository users;

    public DbUserDetailsService(AppUserRepository users) {
        this.users = users;
    }

    @Override
    public UserDetails loadUserByUsername(String username) throws UsernameNotFoundException {
        AppUser u = users.findByUsername(username)
                .orElseThrow(() -> new UsernameNotFoundException("Usuario no existe"));

        return User.builder()
                .username(u.getUsername())
                .password(u.getPasswordHash())
                .disabled(!u.isEnabled())
                .authorities(authoritiesFor(u.getRole()))
                .build();
    }

    static List<GrantedAuthority> authoritiesFor(AppUser.GlobalRole role) {
        List<GrantedAuthority> out = new ArrayList<>();
        out.add(new SimpleGrantedAuthority("ROLE_USER"));
        if (role != null && role != AppUser.GlobalRole.USER) {
            out.add(new SimpleGrantedAuthority("ROLE_" + role.name()));
        }
        return out;
    }
}
