@NamedInterface("api")
package kr.jemi.zcassa.ticket.api;

import org.springframework.modulith.NamedInterface;
